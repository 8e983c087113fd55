package com.acme.corna.common;

public record ApiError(String code, String message) {
}
