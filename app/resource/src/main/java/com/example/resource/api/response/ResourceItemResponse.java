package com.example.resource.api.response;

import com.example.resource.model.ResourceItem;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceItemResponse(
    long id,
    String title,
    String content,
    String type,
    @JsonProperty("created_at") Instant createdAt,
    Boolean sensitive,
    @JsonProperty("access_level") String accessLevel,
    @JsonProperty("accessible_by") String accessibleBy) {

  public static ResourceItemResponse of(ResourceItem item, String accessLevel, String accessibleBy) {
    return new ResourceItemResponse(
        item.id(),
        item.title(),
        item.content(),
        item.type(),
        item.createdAt(),
        item.sensitive() ? Boolean.TRUE : null,
        accessLevel,
        accessibleBy);
  }
}
