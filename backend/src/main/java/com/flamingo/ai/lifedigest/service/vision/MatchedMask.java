package com.flamingo.ai.lifedigest.service.vision;

/** Assignment of one detected object to one segmentation mask. */
public record MatchedMask(int objectIndex, int maskIndex, double iou) {}
