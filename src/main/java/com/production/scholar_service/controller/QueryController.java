package com.production.scholar_service.controller;

import com.production.scholar_service.model.QueryRequest;
import com.production.scholar_service.model.QueryResponse;
import com.production.scholar_service.service.retrieval.RetrievalAnswerEngine;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/query")
@Slf4j
public class QueryController {

    private final RetrievalAnswerEngine answerEngine;

    public QueryController(RetrievalAnswerEngine answerEngine) {
        this.answerEngine = answerEngine;
    }

    @PostMapping
    public ResponseEntity<?> query(@Valid @RequestBody QueryRequest request) {
        log.info("Query request - query: '{}', mode: {}, maxResults: {}, author: {}, years: {}-{}",
                request.getQuery(), request.effectiveMode().key(), request.getMaxResults(),
                request.getAuthor(), request.getYearFrom(), request.getYearTo());
        try {
            QueryResponse response = answerEngine.query(request);
            return ResponseEntity.ok(response);
        } catch (IOException e) {
            log.error("Query failed", e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Internal Server Error",
                    "message", "Search failed: " + e.getMessage()
            ));
        }
    }
}
