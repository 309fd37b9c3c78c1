package com.marketplace.api.dto.request;

import com.marketplace.source.ConnectMode;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class ConnectModeRequest {

    @NotNull
    private ConnectMode mode;
}
