package com.id.beacon.modules.alerts.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlertTargetRequest {

    @NotBlank
    private String chatId;

    @Size(max = 256)
    private String description;

}
