package com.zeronote.server.sync;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.data.repository.NoRepositoryBean;

import reactor.core.publisher.Flux;

@NoRepositoryBean
public interface EntityRowRepository<R extends EntityRow> extends ReactiveCassandraRepository<R, EntityKey> {

    Flux<R> findAllByKeyOwner(String owner);
}
