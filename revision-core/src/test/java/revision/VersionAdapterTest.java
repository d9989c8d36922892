package revision;

import org.junit.jupiter.api.Test;
import revision.codec.JsonSerializationCodec;
import revision.event.StandardChangeEvent;
import revision.event.StringChangeEvent;
import revision.fixture.Library;
import revision.fixture.Library.Author;
import revision.fixture.Library.Book;
import revision.fixture.Library.BookProxy;
import revision.model.EntityModel;
import revision.model.Related;
import revision.model.VersionId;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VersionAdapterTest {

  private static VersionAdapter<Book> books(AdapterOptions options) {
    return new VersionAdapter<>(Library.books(), options, JsonSerializationCodec.INSTANCE);
  }

  @Test
  void defaults() {
    VersionAdapter<Book> adapter = books(AdapterOptions.DEFAULTS);

    assertEquals(List.of("title", "author_id"), adapter.getFieldsToSerialize());
    assertEquals(List.of(), adapter.getFollow());
    assertEquals("json", adapter.getSerializationFormat());
    assertTrue(adapter.isForConcreteModel());
    assertEquals(List.of(StandardChangeEvent.POST_SAVE), adapter.getEvents());
    assertEquals(List.of(), adapter.getEagerEvents());
    assertFalse(adapter.isEager(StandardChangeEvent.POST_SAVE));
  }

  @Test
  void explicitFieldsMinusExcluded() {
    VersionAdapter<Book> adapter = books(AdapterOptions.builder()
        .fields("author_id", "title")
        .exclude("title")
        .build());

    assertEquals(List.of("author_id"), adapter.getFieldsToSerialize());
  }

  @Test
  void unknownFieldIsRejected() {
    assertThrows(RegistrationException.class, () -> books(AdapterOptions.builder().fields("isbn").build()));
    assertThrows(RegistrationException.class, () -> books(AdapterOptions.builder().exclude("isbn").build()));
  }

  @Test
  void unknownRelationIsRejected() {
    RegistrationException ex = assertThrows(RegistrationException.class, () ->
        books(AdapterOptions.builder().follow("publisher").build()));

    assertTrue(ex.getMessage().contains("publisher"));
  }

  @Test
  void unsupportedFormatIsRejected() {
    assertThrows(RegistrationException.class, () -> books(AdapterOptions.builder().format("xml").build()));
  }

  @Test
  void eagerEventsMatchByName() {
    VersionAdapter<Book> adapter = books(AdapterOptions.builder()
        .eagerEvents(StandardChangeEvent.PRE_DELETE)
        .build());

    assertTrue(adapter.isEager(StringChangeEvent.of("PRE_DELETE")));
    assertEquals(List.of(StandardChangeEvent.POST_SAVE, StandardChangeEvent.PRE_DELETE), adapter.getAllEvents());
  }

  @Test
  void followedRelationsFlattenSingleAndMany() {
    VersionAdapter<Author> adapter = new VersionAdapter<>(Library.authors(),
        AdapterOptions.builder().follow("books").build(), JsonSerializationCodec.INSTANCE);
    Author ada = new Author(1L, "Ada");
    Book notes = new Book(10L, "Notes", ada);
    Book letters = new Book(11L, "Letters", ada);

    assertEquals(List.of(notes, letters), adapter.getFollowedRelations(ada));
    assertEquals(List.of(ada), books(AdapterOptions.builder().follow("author").build()).getFollowedRelations(notes));
    assertEquals(List.of(), books(AdapterOptions.builder().follow("author").build())
        .getFollowedRelations(new Book(12L, "Anonymous", null)));
  }

  @Test
  void missingRelationTargetContributesNothing() {
    Book orphan = new Book(10L, "Orphan", new Author(1L, "Ada"));
    orphan.authorDeleted = true;

    assertEquals(List.of(), books(AdapterOptions.builder().follow("author").build()).getFollowedRelations(orphan));
  }

  @Test
  void nullElementInRelationIsRejected() {
    EntityModel<Author> model = EntityModel.builder(Author.class, "library", "author")
        .id(author -> author.id)
        .relation("books", author -> Related.many(Arrays.asList((Book) null)))
        .build();
    VersionAdapter<Author> adapter = new VersionAdapter<>(model,
        AdapterOptions.builder().follow("books").build(), JsonSerializationCodec.INSTANCE);

    assertThrows(RegistrationException.class, () -> adapter.getFollowedRelations(new Author(1L, "Ada")));
  }

  @Test
  void versionIdUsesConcreteModelForProxies() {
    EntityModel<Book> bookModel = Library.books();
    EntityModel<BookProxy> proxyModel = Library.bookProxies(bookModel);
    BookProxy proxy = new BookProxy(10L, "Notes", null);

    VersionAdapter<BookProxy> concrete = new VersionAdapter<>(proxyModel, AdapterOptions.DEFAULTS,
        JsonSerializationCodec.INSTANCE);
    VersionAdapter<BookProxy> own = new VersionAdapter<>(proxyModel,
        AdapterOptions.builder().forConcreteModel(false).build(), JsonSerializationCodec.INSTANCE);

    assertEquals(new VersionId("library", "book", "10"), concrete.getVersionId(proxy));
    assertEquals(new VersionId("library", "bookproxy", "10"), own.getVersionId(proxy));
  }

  @Test
  void unsavedEntityHasNoVersionId() {
    VersionAdapter<Book> adapter = books(AdapterOptions.DEFAULTS);

    assertThrows(IllegalArgumentException.class, () -> adapter.getVersionId(new Book(null, "Draft", null)));
  }

  @Test
  void unsavedEntitiesShareCaptureId() {
    VersionAdapter<Book> adapter = books(AdapterOptions.DEFAULTS);

    VersionId draft = adapter.getCaptureId(new Book(null, "Draft", null));

    assertTrue(draft.isUnsaved());
    assertEquals(VersionId.unsaved("library", "book"), draft);
    assertEquals(draft, adapter.getCaptureId(new Book(null, "Other", null)));
    assertEquals(new VersionId("library", "book", "10"), adapter.getCaptureId(new Book(10L, "Notes", null)));
  }

  @Test
  void versionDataSnapshotsEntity() {
    VersionAdapter<Book> adapter = books(AdapterOptions.builder().exclude("author_id").build());
    Book book = new Book(10L, "Notes", new Author(1L, "Ada"));

    VersionData data = adapter.getVersionData(book, "default");

    assertEquals(new VersionId("library", "book", "10"), data.versionId());
    assertEquals("default", data.resource());
    assertEquals("json", data.format());
    assertEquals("[{\"model\":\"library.book\",\"pk\":\"10\",\"fields\":{\"title\":\"Notes\"}}]", data.serializedData());
    assertEquals("Book Notes", data.objectRepr());
  }

  @Test
  void optionsBuilderIsSingleUse() {
    AdapterOptions.Builder builder = AdapterOptions.builder();
    builder.build();

    assertThrows(IllegalStateException.class, builder::build);
  }
}
