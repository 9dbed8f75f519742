package com.deepansh.trader.memory;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TradingExperienceRepository extends MongoRepository<TradingExperience, String> {

    List<TradingExperience> findByTokenAddressOrderByCreatedAtDesc(String tokenAddress);

    long countByWasProfitable(Boolean wasProfitable);
}
