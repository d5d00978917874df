package com.kb.metering.repository;

import com.kb.metering.model.entity.Livestream;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LivestreamRepository extends ReactiveMongoRepository<Livestream, String> {
}
