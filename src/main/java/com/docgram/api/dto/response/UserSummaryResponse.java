package com.docgram.api.dto.response;

import com.docgram.domain.entity.User;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Compact author reference embedded in posts and comments. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSummaryResponse {

  private UUID id;
  private String username;
  private String avatarUrl;

  public static UserSummaryResponse fromEntity(User user) {
    return UserSummaryResponse.builder()
        .id(user.getId())
        .username(user.getUsername())
        .avatarUrl(user.getAvatarUrl())
        .build();
  }
}
