package com.example.attendance.model;

public record UserIdentity(String userId, String displayName) {}
