package com.vtrader.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Body of {@code POST /api/admin/quotes-batcher/flush}. A blank mode flushes the default "ltp" batch. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManualFlushRequest {

    private String mode;
}
