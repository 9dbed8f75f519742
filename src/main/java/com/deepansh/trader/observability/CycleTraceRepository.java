package com.deepansh.trader.observability;

import org.springframework.data.mongodb.repository.Aggregation;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface CycleTraceRepository extends MongoRepository<CycleTrace, String> {

    List<CycleTrace> findBySessionIdOrderByCycleNumberDesc(String sessionId);

    List<CycleTrace> findTop50ByOrderByCreatedAtDesc();

    @Aggregation(pipeline = {
        "{ $match: { 'createdAt': { $gte: ?0 } } }",
        "{ $group: { _id: null, avg: { $avg: '$totalLatencyMs' } } }"
    })
    Double avgLatencySince(Instant since);

    @Aggregation(pipeline = {
        "{ $match: { 'createdAt': { $gte: ?0 } } }",
        "{ $group: { _id: null, total: { $sum: '$totalTokens' } } }"
    })
    Long totalTokensSince(Instant since);

    @Aggregation(pipeline = {
        "{ $match: { 'createdAt': { $gte: ?0 } } }",
        "{ $group: { _id: '$status', count: { $sum: 1 } } }"
    })
    List<StatusCount> statusBreakdownSince(Instant since);

    record StatusCount(String id, long count) {}
}
