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

package me.golemcore.tripagent.infrastructure.event;

import me.golemcore.tripagent.domain.model.RuntimeEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes progress transitions to Spring listeners. Listeners observe them
 * with {@code @EventListener} on the publishing thread, so a slow listener
 * delays the transition that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringEventBus {

    private final ApplicationEventPublisher eventPublisher;

    public void publish(RuntimeEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("[Progress] {} session={} payload={}", event.type(), event.sessionId(), event.payload());
        }
        eventPublisher.publishEvent(event);
    }
}
