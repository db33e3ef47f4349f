package com.changesentinel.core.model;

public record ListItem(String id, String title, String url, String postedAt) {
}
