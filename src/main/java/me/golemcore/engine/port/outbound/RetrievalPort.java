package me.golemcore.engine.port.outbound;

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

import me.golemcore.engine.domain.model.RetrievedDocument;

import java.util.List;

/**
 * Port for the retrieval subsystem that supplies candidate source documents.
 */
public interface RetrievalPort {

    /**
     * Searches the local knowledge base.
     *
     * @param query
     *            the search query
     * @param recallTerms
     *            optional expanded terms to widen lexical recall, may be empty
     * @return matching documents, best first
     */
    List<RetrievedDocument> search(String query, List<String> recallTerms);
}
