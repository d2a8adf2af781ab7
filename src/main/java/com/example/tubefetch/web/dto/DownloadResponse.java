package com.example.tubefetch.web.dto;

public record DownloadResponse(String jobId) {}
