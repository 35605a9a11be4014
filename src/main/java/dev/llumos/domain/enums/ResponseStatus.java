package dev.llumos.domain.enums;

public enum ResponseStatus {
    SUCCESS, ERROR
}
