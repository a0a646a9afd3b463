package com.scholary.mp3.converter.job;

import java.util.concurrent.atomic.AtomicLong;

/** Strictly increasing identifier source. One instance per entity type; ids start at 1. */
public final class IdSequence {

  private final AtomicLong next;

  public IdSequence() {
    this(1L);
  }

  public IdSequence(long first) {
    this.next = new AtomicLong(first);
  }

  public long nextId() {
    return next.getAndIncrement();
  }
}
