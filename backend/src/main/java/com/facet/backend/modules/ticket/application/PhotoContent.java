package com.facet.backend.modules.ticket.application;

public record PhotoContent(String contentType, byte[] content) {
}
