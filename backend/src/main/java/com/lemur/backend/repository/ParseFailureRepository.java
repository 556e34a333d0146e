package com.lemur.backend.repository;

import com.lemur.backend.model.ParseFailure;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ParseFailureRepository extends MongoRepository<ParseFailure, String> {
}
