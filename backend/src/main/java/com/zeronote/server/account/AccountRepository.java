package com.zeronote.server.account;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountRepository extends ReactiveCassandraRepository<UserAccount, String> {
}
