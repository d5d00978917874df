package com.kb.metering.repository;

import com.kb.metering.model.entity.ReaderProfile;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReaderProfileRepository extends ReactiveMongoRepository<ReaderProfile, String> {
}
