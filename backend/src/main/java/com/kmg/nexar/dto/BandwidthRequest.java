package com.kmg.nexar.dto;

import jakarta.validation.constraints.Min;

public record BandwidthRequest(@Min(0) long bytesPerSecond) {
}
