package io.intellixity.vigil.pipeline;

import io.intellixity.vigil.query.PageRequest;

/**
 * Pagination summary.\n
 *
 * @param total item count after filtering and before slicing\n
 * @param totalPages {@code ceil(total / limit)}\n
 */
public record PageMetadata(int page, int limit, int total, int totalPages, boolean hasNextPage, boolean hasPrevPage) {

  public static PageMetadata of(PageRequest request, int total) {
    int totalPages = (int) ((total + (long) request.limit() - 1) / request.limit());
    return new PageMetadata(
        request.page(),
        request.limit(),
        total,
        totalPages,
        request.page() < totalPages,
        request.page() > 1
    );
  }
}
