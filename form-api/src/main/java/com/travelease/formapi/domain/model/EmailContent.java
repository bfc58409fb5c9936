package com.travelease.formapi.domain.model;

public record EmailContent(String subject, String text, String html) {}
