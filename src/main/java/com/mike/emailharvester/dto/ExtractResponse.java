package com.mike.emailharvester.dto;

import java.util.Set;

public record ExtractResponse(String pageUrl, Set<String> emails) {
}
