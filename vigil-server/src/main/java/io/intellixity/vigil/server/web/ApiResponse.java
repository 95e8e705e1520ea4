package io.intellixity.vigil.server.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.intellixity.vigil.item.Item;
import io.intellixity.vigil.pipeline.PageMetadata;
import io.intellixity.vigil.pipeline.PagedResult;

import java.util.List;

/** Response envelope shared by every API endpoint. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, PageMetadata pagination, String message, String error) {

  public static <T> ApiResponse<T> ok(T data) {
    return new ApiResponse<>(true, data, null, null, null);
  }

  public static ApiResponse<List<Item>> page(PagedResult result) {
    return new ApiResponse<>(true, result.data(), result.pagination(), null, null);
  }

  public static ApiResponse<Void> message(String message) {
    return new ApiResponse<>(true, null, null, message, null);
  }

  public static ApiResponse<Void> error(String error) {
    return new ApiResponse<>(false, null, null, null, error);
  }
}
