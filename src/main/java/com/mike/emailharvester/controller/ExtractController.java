package com.mike.emailharvester.controller;

import com.mike.emailharvester.dto.ExtractRequest;
import com.mike.emailharvester.dto.ExtractResponse;
import com.mike.emailharvester.service.EmailExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequiredArgsConstructor
public class ExtractController {

    private final EmailExtractor emailExtractor;

    @PostMapping("/api/extract")
    public ResponseEntity<?> extract(@RequestBody ExtractRequest request) {
        if (request == null || request.html() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "html is required"));
        }
        return ResponseEntity.ok(new ExtractResponse(
                request.pageUrl(),
                emailExtractor.extractEmails(request.html(), request.pageUrl())));
    }
}
