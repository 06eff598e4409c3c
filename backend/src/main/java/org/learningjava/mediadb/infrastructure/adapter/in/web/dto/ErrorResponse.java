package org.learningjava.mediadb.infrastructure.adapter.in.web.dto;

public record ErrorResponse(String error, String detail) {
}
