package com.logflow.anomaly.repositories;


import com.logflow.anomaly.model.entities.LogEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface LogEventRepository extends JpaRepository<LogEventEntity, Long> {

    String BUCKET_SELECT = "SELECT CAST(FLOOR(EXTRACT(EPOCH FROM e.ts_utc) / :bucketSeconds) AS BIGINT) * :bucketSeconds AS \"bucketEpoch\", "
            + "COUNT(*) AS \"total\", "
            + "SUM(CASE WHEN e.level IN ('ERROR', 'CRITICAL') THEN 1 ELSE 0 END) AS \"errors\" "
            + "FROM public.t_log_event e "
            + "WHERE e.ts_utc >= :fromTs AND e.ts_utc < :toTs ";

    String BUCKET_GROUP = "GROUP BY 1 ORDER BY 1";

    @Query(value = BUCKET_SELECT + BUCKET_GROUP, nativeQuery = true)
    List<BucketCount> countByBucket(@Param("fromTs") Instant from,
                                    @Param("toTs") Instant to,
                                    @Param("bucketSeconds") long bucketSeconds);

    @Query(value = BUCKET_SELECT + "AND e.service = :service " + BUCKET_GROUP, nativeQuery = true)
    List<BucketCount> countByBucketAndService(@Param("fromTs") Instant from,
                                              @Param("toTs") Instant to,
                                              @Param("bucketSeconds") long bucketSeconds,
                                              @Param("service") String service);
}
