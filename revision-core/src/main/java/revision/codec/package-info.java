/**
 * Built-in {@link revision.spi.SerializationCodec} implementations.
 */
package revision.codec;
