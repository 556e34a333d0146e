package com.lemur.backend.repository;

import com.lemur.backend.model.SessionSnapshot;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionSnapshotRepository extends MongoRepository<SessionSnapshot, String> {

    List<SessionSnapshot> findBySessionIdOrderBySavedAtDesc(String sessionId);
}
