package com.example.matrixgame.game.dto.request;

import com.example.matrixgame.game.domain.state.GameRole;
import jakarta.validation.constraints.NotNull;

public record SetPlayerRoleRequest(@NotNull GameRole role) {
}
