package org.netpreserve.sweeper.db;

import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;

@RegisterConstructorMapper(FollowerMetric.class)
public interface MetricDAO {
    @SqlUpdate("""
            INSERT INTO target_metrics (target_id, collected_on, follower_text, follower_count)
            VALUES (:targetId, :collectedOn, :followerText, :followerCount)
            ON CONFLICT (target_id, collected_on) DO UPDATE SET
                follower_text = excluded.follower_text,
                follower_count = excluded.follower_count""")
    void upsertFollowers(@BindMethods FollowerMetric metric);

    @SqlQuery("SELECT * FROM target_metrics WHERE target_id = ? ORDER BY collected_on")
    List<FollowerMetric> followerHistory(long targetId);
}
