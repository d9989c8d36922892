package revision.spring;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import revision.Revision;
import revision.RevisionScope;
import revision.Revisions;
import revision.event.DefaultChangeEventDispatcher;
import revision.event.StandardChangeEvent;
import revision.model.EntityModel;
import revision.spi.TransactionSupport;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class SpringTransactionSupportTest {

  record Account(long id, String owner) {
  }

  private static final EntityModel<Account> ACCOUNTS = EntityModel.builder(Account.class, "bank", "account")
      .id(Account::id)
      .field("owner", Account::owner)
      .build();

  private JdbcDataSource dataSource;
  private DataSourceTransactionManager txManager;
  private JdbcTemplate jdbc;
  private SpringTransactionSupport txSupport;
  private DefaultChangeEventDispatcher changes;
  private List<Revision> emitted;
  private Revisions revisions;

  @BeforeEach
  void setup() {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:revision_spring_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    dataSource = ds;
    txManager = new DataSourceTransactionManager(ds);
    jdbc = new JdbcTemplate(ds);
    jdbc.execute("CREATE TABLE account (id BIGINT PRIMARY KEY, owner VARCHAR(64))");
    jdbc.execute("CREATE TABLE revision_log (revision_id VARCHAR(26) PRIMARY KEY, object_count INT)");

    txSupport = new SpringTransactionSupport(txManager);
    changes = new DefaultChangeEventDispatcher();
    emitted = new CopyOnWriteArrayList<>();
    revisions = Revisions.builder()
        .slug("spring-" + UUID.randomUUID())
        .transactionSupport(txSupport)
        .dispatcher(changes)
        .revisionListener(revision -> {
          assertTrue(txSupport.isTransactionActive());
          jdbc.update("INSERT INTO revision_log (revision_id, object_count) VALUES (?, ?)",
              revision.revisionId(), revision.size());
          emitted.add(revision);
        })
        .build();
    revisions.register(ACCOUNTS);
  }

  @AfterEach
  void teardown() {
    revisions.close();
  }

  @Test
  void nullTransactionManagerThrows() {
    assertThrows(NullPointerException.class, () ->
        new SpringTransactionSupport((DataSourceTransactionManager) null));
  }

  @Test
  void emptyTransactionManagerMapThrows() {
    assertThrows(IllegalArgumentException.class, () -> new SpringTransactionSupport(Map.of()));
  }

  @Test
  void unknownResourceThrows() {
    assertThrows(IllegalArgumentException.class, () -> txSupport.begin("reporting"));
  }

  @Test
  void scopeRunsInSpringTransaction() throws Exception {
    assertFalse(txSupport.isTransactionActive());

    revisions.createRevision().execute(() -> {
      assertTrue(txSupport.isTransactionActive());
      save(new Account(1, "ada"));
      return null;
    });

    assertFalse(txSupport.isTransactionActive());
    assertEquals(1, count("account"));
    assertEquals(1, count("revision_log"));
    assertEquals(List.of(new Account(1, "ada")), emitted.get(0).objects());
  }

  @Test
  void failedScopeRollsBack() {
    assertThrows(IllegalStateException.class, () -> revisions.createRevision().execute(() -> {
      save(new Account(1, "ada"));
      throw new IllegalStateException("boom");
    }));

    assertEquals(0, count("account"));
    assertEquals(0, count("revision_log"));
    assertTrue(emitted.isEmpty());
  }

  @Test
  void failedNestedScopeRollsBackToSavepoint() throws Exception {
    RevisionScope scope = revisions.createRevision();

    scope.execute(() -> {
      save(new Account(1, "ada"));
      assertThrows(IllegalStateException.class, () -> scope.execute(() -> {
        save(new Account(2, "grace"));
        throw new IllegalStateException("inner failed");
      }));
      return null;
    });

    assertEquals(1, count("account"));
    assertEquals(1, emitted.size());
    assertEquals(List.of(new Account(1, "ada")), emitted.get(0).objects());
  }

  @Test
  void scopeJoinsSurroundingSpringTransaction() throws Exception {
    TransactionStatus outer = txManager.getTransaction(new DefaultTransactionDefinition());
    try {
      revisions.createRevision().execute(() -> {
        save(new Account(1, "ada"));
        return null;
      });
      assertEquals(1, emitted.size());
    } finally {
      txManager.rollback(outer);
    }

    assertEquals(0, count("account"));
    assertEquals(0, count("revision_log"));
  }

  @Test
  void afterCommitCallbackRunsWhenScopeCommits() throws Exception {
    List<String> calls = new ArrayList<>();

    revisions.createRevision().execute(() -> {
      txSupport.afterCommit(() -> calls.add("commit"));
      txSupport.afterRollback(() -> calls.add("rollback"));
      return null;
    });

    assertEquals(List.of("commit"), calls);
  }

  @Test
  void afterRollbackCallbackRunsWhenScopeFails() {
    List<String> calls = new ArrayList<>();

    assertThrows(IllegalStateException.class, () -> revisions.createRevision().execute(() -> {
      txSupport.afterCommit(() -> calls.add("commit"));
      txSupport.afterRollback(() -> calls.add("rollback"));
      throw new IllegalStateException("boom");
    }));

    assertEquals(List.of("rollback"), calls);
  }

  @Test
  void currentConnectionIsTheTransactionConnection() throws Exception {
    revisions.createRevision().execute(() -> {
      Connection conn = txSupport.currentConnection(dataSource);
      assertFalse(conn.getAutoCommit());
      try (PreparedStatement ps = conn.prepareStatement("INSERT INTO account (id, owner) VALUES (?, ?)")) {
        ps.setLong(1, 7);
        ps.setString(2, "linus");
        ps.executeUpdate();
      }
      return null;
    });

    assertEquals(1, count("account"));
    assertThrows(IllegalStateException.class, () -> txSupport.currentConnection(dataSource));
  }

  @Test
  void callbacksRequireActiveTransaction() {
    assertThrows(IllegalStateException.class, () -> txSupport.afterCommit(() -> { }));
    assertThrows(IllegalStateException.class, () -> txSupport.afterRollback(() -> { }));
  }

  @Test
  void completingTwiceIsNoOp() {
    TransactionSupport.AtomicBlock block = txSupport.begin("default");
    block.commit();

    assertDoesNotThrow(block::commit);
    assertDoesNotThrow(block::rollback);
    assertFalse(txSupport.isTransactionActive());
  }

  private void save(Account account) {
    jdbc.update("INSERT INTO account (id, owner) VALUES (?, ?)", account.id(), account.owner());
    changes.fire(StandardChangeEvent.POST_SAVE, account);
  }

  private int count(String table) {
    Integer count = jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
    return count == null ? 0 : count;
  }
}
