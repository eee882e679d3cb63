package com.cactisynth.render;

/** Output of rendering one planned note. */
public record RenderedNote(NotePlan plan, double[] samples, int sampleRate) {}
