package com.example.federation.repo;

import com.example.federation.model.PduRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PduRepo extends MongoRepository<PduRecord, String> {
    List<PduRecord> findByRoomIdAndStateKeyNotNull(String roomId);
    List<PduRecord> findByRoomIdAndTypeAndStateKey(String roomId, String type, String stateKey);
    boolean existsByRoomId(String roomId);
}
