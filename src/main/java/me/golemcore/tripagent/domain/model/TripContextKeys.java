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

package me.golemcore.tripagent.domain.model;

import java.util.List;

/**
 * Well-known keys of the trip context map.
 */
public final class TripContextKeys {

    public static final String DESTINATION = "destination";
    public static final String DAYS = "days";
    public static final String BUDGET = "budget";
    public static final String START_DATE = "startDate";
    public static final String INTERESTS = "interests";

    public static final List<String> ALL = List.of(DESTINATION, DAYS, BUDGET, START_DATE, INTERESTS);

    private TripContextKeys() {
    }
}
