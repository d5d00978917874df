package com.kb.metering.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.ReactiveMongoDatabaseFactory;
import org.springframework.data.mongodb.ReactiveMongoTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

/**
 * MongoDB 트랜잭션 설정
 * 잔액/세션/정산 문서를 하나의 트랜잭션으로 저장하기 위한 설정
 */
@Configuration
public class MongoConfig {

    @Bean
    public ReactiveMongoTransactionManager reactiveMongoTransactionManager(ReactiveMongoDatabaseFactory databaseFactory) {
        return new ReactiveMongoTransactionManager(databaseFactory);
    }

    /**
     * 원장 변경용 트랜잭션 오퍼레이터
     */
    @Bean
    public TransactionalOperator ledgerTransactionalOperator(ReactiveMongoTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }
}
