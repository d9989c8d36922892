package revision.registry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import revision.AdapterOptions;
import revision.RegistrationException;
import revision.Revision;
import revision.VersionAdapter;
import revision.codec.JsonSerializationCodec;
import revision.context.RevisionContextManager;
import revision.event.DefaultChangeEventDispatcher;
import revision.event.StandardChangeEvent;
import revision.event.StringChangeEvent;
import revision.fixture.Library;
import revision.fixture.Library.Author;
import revision.fixture.Library.Book;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RevisionManagerTest {

  private final List<RevisionManager> opened = new ArrayList<>();

  private RevisionContextManager context;
  private DefaultChangeEventDispatcher changes;
  private RevisionManager manager;
  private List<Revision> emitted;

  @BeforeEach
  void setUp() {
    context = new RevisionContextManager();
    changes = new DefaultChangeEventDispatcher();
    manager = open("registry-" + UUID.randomUUID());
    emitted = new ArrayList<>();
    manager.addRevisionListener(emitted::add);
  }

  @AfterEach
  void tearDown() {
    opened.forEach(RevisionManager::close);
  }

  @Test
  void registerSubscribesAllEvents() {
    manager.register(Library.books(), AdapterOptions.builder()
        .eagerEvents(StandardChangeEvent.PRE_DELETE)
        .build());

    assertTrue(manager.isRegistered(Book.class));
    assertFalse(manager.isRegistered(Author.class));
    assertEquals(List.of(Book.class), manager.getRegisteredModels());
    assertEquals(1, changes.receiverCount(Book.class, StandardChangeEvent.POST_SAVE));
    assertEquals(1, changes.receiverCount(Book.class, StandardChangeEvent.PRE_DELETE));
    assertEquals(0, changes.receiverCount(Book.class, StandardChangeEvent.POST_DELETE));
  }

  @Test
  void registeringTwiceFails() {
    manager.register(Library.books());

    RegistrationException ex = assertThrows(RegistrationException.class, () -> manager.register(Library.books()));
    assertTrue(ex.getMessage().contains("has already been registered"));
  }

  @Test
  void invalidOptionsFailBeforeSubscribing() {
    assertThrows(RegistrationException.class, () ->
        manager.register(Library.books(), AdapterOptions.builder().follow("publisher").build()));

    assertFalse(manager.isRegistered(Book.class));
    assertEquals(0, changes.receiverCount(Book.class, StandardChangeEvent.POST_SAVE));
  }

  @Test
  void customAdapterFactoryIsUsed() {
    manager.register(Library.books(), (model, options, codec) -> new VersionAdapter<>(model, options, codec) {
      @Override
      public List<String> getFieldsToSerialize() {
        return List.of("title");
      }
    }, AdapterOptions.DEFAULTS);

    assertEquals(List.of("title"), manager.getAdapter(Book.class).getFieldsToSerialize());
  }

  @Test
  void unregisterRemovesSubscriptions() {
    manager.register(Library.books());

    manager.unregister(Book.class);

    assertFalse(manager.isRegistered(Book.class));
    assertEquals(0, changes.receiverCount(Book.class, StandardChangeEvent.POST_SAVE));
    assertThrows(RegistrationException.class, () -> manager.unregister(Book.class));
    assertThrows(RegistrationException.class, () -> manager.getAdapter(Book.class));
  }

  @Test
  void slugsAreUniqueWhileOpen() {
    String slug = manager.slug();

    assertThrows(RegistrationException.class, () -> open(slug));
    assertSame(manager, RevisionManager.getManager(slug));
    assertTrue(RevisionManager.getCreatedManagers().contains(manager));
  }

  @Test
  void closeReleasesSlugAndUnregisters() {
    manager.register(Library.books());
    String slug = manager.slug();

    manager.close();
    manager.close();

    assertEquals(0, changes.receiverCount(Book.class, StandardChangeEvent.POST_SAVE));
    assertThrows(RegistrationException.class, () -> RevisionManager.getManager(slug));
    assertThrows(RegistrationException.class, () -> manager.register(Library.authors()));
    assertNotNull(open(slug));
  }

  @Test
  void eventsOutsideScopeAreIgnored() {
    manager.register(Library.authors());

    changes.fire(StandardChangeEvent.POST_SAVE, new Author(1L, "Ada"));

    assertTrue(emitted.isEmpty());
  }

  @Test
  void deferredEventCapturesLiveEntity() throws Exception {
    manager.register(Library.authors());
    Author ada = new Author(1L, "Ada");

    context.createRevision().execute(() -> {
      changes.fire(StandardChangeEvent.POST_SAVE, ada);
      changes.fire(StandardChangeEvent.POST_SAVE, ada);
      return null;
    });

    assertEquals(1, emitted.size());
    assertEquals(List.of(ada), emitted.get(0).objects());
  }

  @Test
  void manualScopeIgnoresEventsButAcceptsExplicitCaptures() throws Exception {
    manager.register(Library.authors());
    Author ada = new Author(1L, "Ada");
    Author grace = new Author(2L, "Grace");

    context.createRevision(true).execute(() -> {
      changes.fire(StandardChangeEvent.POST_SAVE, ada);
      context.addToContext(manager, grace);
      return null;
    });

    assertEquals(List.of(grace), emitted.get(0).objects());
  }

  @Test
  void eagerEventSnapshotsEntityBeforeDeletion() throws Exception {
    manager.register(Library.books(), AdapterOptions.builder()
        .eagerEvents(StandardChangeEvent.PRE_DELETE)
        .build());
    Book book = new Book(10L, "Notes", null);

    context.createRevision().execute(() -> {
      changes.fire(StandardChangeEvent.PRE_DELETE, book);
      book.id = null;
      return null;
    });

    Revision revision = emitted.get(0);
    assertEquals(List.of(), revision.objects());
    assertEquals(1, revision.serializedObjects().size());
    assertEquals("library.book#10", revision.serializedObjects().get(0).versionId().toString());
  }

  @Test
  void eagerSnapshotsNameTheInnermostResource() throws Exception {
    manager.register(Library.books(), AdapterOptions.builder()
        .eagerEvents(StandardChangeEvent.PRE_DELETE)
        .build());
    Book notes = new Book(10L, "Notes", null);
    Book letters = new Book(11L, "Letters", null);

    context.createRevision().execute(() -> {
      changes.fire(StandardChangeEvent.PRE_DELETE, notes);
      return context.createRevision(false, "audit").execute(() -> {
        changes.fire(StandardChangeEvent.PRE_DELETE, letters);
        return null;
      });
    });

    List<String> resources = emitted.get(emitted.size() - 1).serializedObjects().stream()
        .map(data -> data.versionId().objectId() + "@" + data.resource())
        .toList();
    assertEquals(List.of("10@default", "11@audit"), resources);
  }

  @Test
  void eventsMatchByName() throws Exception {
    manager.register(Library.authors(), AdapterOptions.builder()
        .events(StringChangeEvent.of("POST_ARCHIVE"))
        .build());
    Author ada = new Author(1L, "Ada");

    context.createRevision().execute(() -> {
      changes.fire(StandardChangeEvent.POST_SAVE, ada);
      changes.fire(StringChangeEvent.of("POST_ARCHIVE"), ada);
      return null;
    });

    assertEquals(List.of(ada), emitted.get(0).objects());
  }

  @Test
  void followRelationshipsSurvivesCycles() {
    manager.register(Library.authors(), AdapterOptions.builder().follow("books").build());
    manager.register(Library.books(), AdapterOptions.builder().follow("author").build());
    Author ada = new Author(1L, "Ada");
    Book notes = new Book(10L, "Notes", ada);
    Book letters = new Book(11L, "Letters", ada);

    List<Object> followed = List.copyOf(manager.followRelationships(notes));

    assertEquals(List.of(notes, ada, letters), followed);
  }

  @Test
  void followRelationshipsSkipsUnsavedEntities() {
    manager.register(Library.authors(), AdapterOptions.builder().follow("books").build());
    manager.register(Library.books(), AdapterOptions.builder().follow("author").build());
    Author ada = new Author(1L, "Ada");
    new Book(null, "Draft", ada);
    Book saved = new Book(11L, "Letters", ada);

    assertEquals(List.of(ada, saved), List.copyOf(manager.followRelationships(ada)));
  }

  @Test
  void followRelationshipsSkipsMissingObjects() {
    manager.register(Library.authors());
    manager.register(Library.books(), AdapterOptions.builder().follow("author").build());
    Book orphan = new Book(10L, "Orphan", new Author(1L, "Ada"));
    orphan.authorDeleted = true;

    assertEquals(List.of(orphan), List.copyOf(manager.followRelationships(orphan)));
  }

  @Test
  void followingUnregisteredModelFails() {
    manager.register(Library.books(), AdapterOptions.builder().follow("author").build());
    Book book = new Book(10L, "Notes", new Author(1L, "Ada"));

    assertThrows(RegistrationException.class, () -> manager.followRelationships(book));
  }

  @Test
  void unsavedEntityOfUnregisteredModelEndsBranch() {
    manager.register(Library.books(), AdapterOptions.builder().follow("author").build());
    Book book = new Book(10L, "Notes", new Author(null, "Draft"));

    assertEquals(List.of(book), List.copyOf(manager.followRelationships(book)));
  }

  @Test
  void unsavedEntitiesAreCapturedByDeferredEvents() throws Exception {
    manager.register(Library.authors(), AdapterOptions.builder()
        .events(StandardChangeEvent.POST_SAVE, StringChangeEvent.of("PRE_SAVE"))
        .build());
    Author first = new Author(null, "First");
    Author second = new Author(null, "Second");
    Author saved = new Author(1L, "Ada");

    context.createRevision().execute(() -> {
      changes.fire(StringChangeEvent.of("PRE_SAVE"), first);
      changes.fire(StringChangeEvent.of("PRE_SAVE"), second);
      changes.fire(StandardChangeEvent.POST_SAVE, saved);
      return null;
    });

    assertEquals(List.of(second, saved), emitted.get(0).objects());
  }

  @Test
  void unsavedEntityCanBeAddedExplicitly() throws Exception {
    manager.register(Library.authors());
    Author draft = new Author(null, "Draft");

    context.createRevision(true).execute(() -> {
      context.addToContext(manager, draft);
      return null;
    });

    assertEquals(List.of(draft), emitted.get(0).objects());
  }

  @Test
  void proxyModelIsCapturedUnderConcreteModel() throws Exception {
    var books = Library.books();
    manager.register(books);
    manager.register(Library.bookProxies(books));
    Book book = new Book(10L, "Notes", null);
    Library.BookProxy proxy = new Library.BookProxy(10L, "Notes", null);

    context.createRevision().execute(() -> {
      changes.fire(StandardChangeEvent.POST_SAVE, book);
      changes.fire(StandardChangeEvent.POST_SAVE, proxy);
      return null;
    });

    assertEquals(List.of(proxy), emitted.get(0).objects());
  }

  private RevisionManager open(String slug) {
    RevisionManager created = new RevisionManager(slug, context, changes, JsonSerializationCodec.INSTANCE);
    opened.add(created);
    return created;
  }
}
