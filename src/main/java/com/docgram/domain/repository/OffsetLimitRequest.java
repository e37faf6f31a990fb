package com.docgram.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/** {@link Pageable} addressed by raw offset and limit rather than page number. */
public final class OffsetLimitRequest implements Pageable {

  private final long offset;
  private final int limit;
  private final Sort sort;

  private OffsetLimitRequest(long offset, int limit, Sort sort) {
    if (offset < 0) {
      throw new IllegalArgumentException("Offset must not be negative");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("Limit must be at least 1");
    }
    this.offset = offset;
    this.limit = limit;
    this.sort = sort;
  }

  public static OffsetLimitRequest of(long offset, int limit) {
    return new OffsetLimitRequest(offset, limit, Sort.unsorted());
  }

  @Override
  public int getPageNumber() {
    return (int) (offset / limit);
  }

  @Override
  public int getPageSize() {
    return limit;
  }

  @Override
  public long getOffset() {
    return offset;
  }

  @Override
  public Sort getSort() {
    return sort;
  }

  @Override
  public Pageable next() {
    return new OffsetLimitRequest(offset + limit, limit, sort);
  }

  @Override
  public Pageable previousOrFirst() {
    return hasPrevious()
        ? new OffsetLimitRequest(Math.max(0, offset - limit), limit, sort)
        : first();
  }

  @Override
  public Pageable first() {
    return new OffsetLimitRequest(0, limit, sort);
  }

  @Override
  public Pageable withPage(int pageNumber) {
    return new OffsetLimitRequest((long) pageNumber * limit, limit, sort);
  }

  @Override
  public boolean hasPrevious() {
    return offset > 0;
  }
}
