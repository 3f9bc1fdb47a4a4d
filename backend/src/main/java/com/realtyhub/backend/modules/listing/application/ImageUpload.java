package com.realtyhub.backend.modules.listing.application;

public record ImageUpload(String fileName, String contentType, byte[] content) {
}
