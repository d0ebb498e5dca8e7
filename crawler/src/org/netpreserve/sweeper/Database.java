package org.netpreserve.sweeper;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.argument.ArgumentFactory;
import org.jdbi.v3.core.argument.NullArgument;
import org.jdbi.v3.core.config.JdbiConfig;
import org.jdbi.v3.core.statement.ParsedSql;
import org.jdbi.v3.core.statement.SqlLogger;
import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.sqlobject.CreateSqlObject;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.jdbi.v3.sqlobject.transaction.Transactional;
import org.netpreserve.sweeper.db.ItemDAO;
import org.netpreserve.sweeper.db.MetricDAO;
import org.netpreserve.sweeper.db.TargetDAO;
import org.netpreserve.sweeper.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static org.jdbi.v3.core.generic.GenericTypes.getErasedType;

/**
 * The SQLite ledger. Opened through a single pooled connection, SQLite allows only one writer anyway.
 */
public interface Database extends AutoCloseable, Transactional<Database> {
    /**
     * Version of schema.sql. Stored in the database's user_version so that a ledger written by a newer build is
     * refused rather than corrupted.
     */
    int SCHEMA_VERSION = 1;

    static Database newDatabaseInMemory() {
        return open("jdbc:sqlite::memory:");
    }

    static Database open(Path path) {
        return open("jdbc:sqlite:" + path);
    }

    static Database open(String jdbcUrl) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setMaximumPoolSize(1);
        if (jdbcUrl.endsWith(":memory:")) {
            // an in-memory database lives only as long as its connection
            config.setMaxLifetime(0);
            config.setConnectionInitSql("PRAGMA foreign_keys = ON;");
        } else {
            // every checkpoint is a commit, WAL keeps them cheap
            config.setConnectionInitSql("PRAGMA journal_mode = WAL; PRAGMA synchronous = NORMAL; " +
                                        "PRAGMA foreign_keys = ON; PRAGMA busy_timeout = 60000;");
        }
        var dataSource = new HikariDataSource(config);
        var jdbi = Jdbi.create(dataSource);
        jdbi.installPlugin(new SqlObjectPlugin());
        jdbi.registerColumnMapper(Url.class, (r, col, ctx) -> {
            String value = r.getString(col);
            return value == null ? null : new Url(value);
        });
        jdbi.registerArgument(argument(Url.class, Types.VARCHAR, Url::toString));
        // instants are stored as epoch millis so that SQL can compare them
        jdbi.registerColumnMapper(Instant.class, (r, col, ctx) -> {
            long millis = r.getLong(col);
            return r.wasNull() ? null : Instant.ofEpochMilli(millis);
        });
        jdbi.registerArgument(argument(Instant.class, Types.BIGINT, Instant::toEpochMilli));
        jdbi.getConfig(DataSourceHolder.class).dataSource = dataSource;
        jdbi.setSqlLogger(new SqlLogger() {
            private static final Logger log = LoggerFactory.getLogger(Database.class);

            @Override
            public void logAfterExecution(StatementContext context) {
                if (context.getExecutionMoment() == null || context.getCompletionMoment() == null) return;
                long millis = Duration.between(context.getExecutionMoment(), context.getCompletionMoment()).toMillis();
                if (millis > 100) {
                    ParsedSql parsedSql = context.getParsedSql();
                    log.atWarn().addKeyValue("millis", millis)
                            .log("[Slow SQL] {}", parsedSql != null ? parsedSql.getSql() : "<sql unavailable>");
                }
            }
        });
        Database db = jdbi.onDemand(Database.class);
        db.init();
        return db;
    }

    @SuppressWarnings("unchecked")
    private static <T> ArgumentFactory.Preparable argument(Class<T> clazz, int sqlType, Function<T, Object> getter) {
        return (type, config) -> {
            if (!clazz.isAssignableFrom(getErasedType(type))) return Optional.empty();
            return Optional.of(value -> {
                if (value == null) return new NullArgument(sqlType);
                return (pos, stmt, ctx) -> stmt.setObject(pos, getter.apply((T) value), sqlType);
            });
        };
    }

    default void init() {
        useHandle(handle -> {
            int version = handle.createQuery("PRAGMA user_version").mapTo(Integer.class).one();
            if (version > SCHEMA_VERSION) {
                throw new IllegalStateException("Ledger schema version " + version + " is newer than supported (" +
                                                SCHEMA_VERSION + ")");
            }
            // @SqlScript can't be used as sqlite needs executeAsSeparateStatements()
            handle.createScript(readSchema()).executeAsSeparateStatements();
            if (version < SCHEMA_VERSION) handle.execute("PRAGMA user_version = " + SCHEMA_VERSION);
        });
    }

    private static String readSchema() {
        try (var stream = Objects.requireNonNull(Database.class.getResourceAsStream("schema.sql"), "missing schema.sql")) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @CreateSqlObject
    TargetDAO targets();

    @CreateSqlObject
    ItemDAO items();

    @CreateSqlObject
    MetricDAO metrics();

    default HikariDataSource dataSource() {
        return withHandle(handle -> handle.getConfig(DataSourceHolder.class).dataSource);
    }

    default void close() {
        dataSource().close();
    }

    class DataSourceHolder implements JdbiConfig<DataSourceHolder> {
        private HikariDataSource dataSource;

        public DataSourceHolder() {
        }

        @Override
        public DataSourceHolder createCopy() {
            var copy = new DataSourceHolder();
            copy.dataSource = dataSource;
            return copy;
        }
    }
}
