package com.example.federation.repo;

import com.example.federation.model.RoomMembership;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface MembershipRepo extends MongoRepository<RoomMembership, String> {
}
