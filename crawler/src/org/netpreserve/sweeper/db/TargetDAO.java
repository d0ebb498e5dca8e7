package org.netpreserve.sweeper.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.statement.GetGeneratedKeys;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import org.netpreserve.sweeper.Target;
import org.netpreserve.sweeper.util.MustUpdate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@RegisterConstructorMapper(Target.class)
public interface TargetDAO {
    @SqlUpdate("INSERT INTO targets (username, priority, worker_id) VALUES (:username, :priority, :workerId)")
    @GetGeneratedKeys
    long insert(String username, int priority, Long workerId);

    @SqlQuery("SELECT * FROM targets WHERE id = ?")
    Optional<Target> find(long id);

    @SqlQuery("SELECT * FROM targets WHERE username = ?")
    Optional<Target> findByUsername(String username);

    @SqlQuery("""
            SELECT * FROM targets
            WHERE alive AND worker_id = :workerId
            ORDER BY last_crawled IS NOT NULL, priority DESC, last_crawled, id
            LIMIT :limit""")
    List<Target> forWorker(long workerId, int limit);

    @SqlUpdate("UPDATE targets SET display_name = :displayName WHERE id = :id")
    @MustUpdate
    void setDisplayName(long id, String displayName);

    @SqlUpdate("UPDATE targets SET alive = 0 WHERE id = ?")
    @MustUpdate
    void markGone(long id);

    @SqlUpdate("""
            UPDATE targets SET last_crawled = :when
            WHERE id = :id AND (last_crawled IS NULL OR last_crawled < :when)""")
    int touchLastCrawled(long id, Instant when);

    @SqlUpdate("UPDATE targets SET sweep_started_at = :now WHERE id = :id AND is_new AND sweep_started_at IS NULL")
    int beginSweep(long id, Instant now);

    @SqlUpdate("UPDATE targets SET is_new = 0, sweep_started_at = NULL WHERE id = ? AND is_new")
    int markSwept(long id);
}
