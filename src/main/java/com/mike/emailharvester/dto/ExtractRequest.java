package com.mike.emailharvester.dto;

public record ExtractRequest(String html, String pageUrl) {
}
