package com.auctionvault.domain.model;

import com.auctionvault.domain.enums.SystemState;
import lombok.Value;

@Value
public class SystemStatus {

    SystemState state;
    boolean paused;
}
