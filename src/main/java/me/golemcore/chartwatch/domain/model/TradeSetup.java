package me.golemcore.chartwatch.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Concrete trade plan attached to a directional signal. Prices are
 * {@code null} when the analysis could not place them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeSetup {

    /** Setup grade, {@code A} to {@code C}. */
    private String quality;
    private Double entryPrice;
    private Double stopLoss;
    private Double targetPrice;
    private String description;

    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    /**
     * Whether entry, stop and target are all known.
     */
    public boolean isComplete() {
        return entryPrice != null && stopLoss != null && targetPrice != null;
    }
}
