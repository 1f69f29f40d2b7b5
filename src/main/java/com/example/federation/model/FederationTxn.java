package com.example.federation.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("federation_txns")
public class FederationTxn {
    @Id
    private String id; // origin|txnId
    private String origin;
    private String txnId;
    private Instant processedAt;
    private List<Map<String, Object>> results;

    public static String idOf(String origin, String txnId) {
        return origin + "|" + txnId;
    }
}
