package com.ward.core.issue;

public record CodeExample(String before, String after, String language) {
}
