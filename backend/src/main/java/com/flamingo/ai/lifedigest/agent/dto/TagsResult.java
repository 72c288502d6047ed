package com.flamingo.ai.lifedigest.agent.dto;

import java.util.List;

/** Structured output from TagsAgent. */
public record TagsResult(List<String> tags) {}
