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


package me.golemcore.engine.adapter.outbound.retrieval;

import me.golemcore.engine.domain.model.RetrievedDocument;
import me.golemcore.engine.port.outbound.RetrievalPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Retrieval adapter used when no knowledge base is attached; every search
 * returns no documents.
 */
@Component
@Slf4j
public class NoOpRetrievalAdapter implements RetrievalPort {

    @Override
    public List<RetrievedDocument> search(String query, List<String> recallTerms) {
        log.debug("[Retrieval] no knowledge base configured, query '{}' returns nothing", query);
        return List.of();
    }
}
