package com.example.federation.repo;

import com.example.federation.model.FederationTxn;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface FederationTxnRepo extends MongoRepository<FederationTxn, String> {}
