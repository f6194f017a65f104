package com.libragraph.filestore.api.dto;

public record ErrorResponse(String error) {}
