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

package me.golemcore.governor.domain.exception;

import me.golemcore.governor.domain.model.CandidateFailure;
import me.golemcore.governor.domain.model.FailureKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every candidate backend was tried (or skipped) without a response. Carries
 * the failure of each candidate in the order they were attempted.
 */
public class AllBackendsExhaustedException extends GovernorException {

    private static final long serialVersionUID = 1L;

    private final transient List<CandidateFailure> failures;

    public AllBackendsExhaustedException(List<CandidateFailure> failures) {
        super("All backends exhausted: " + failures.stream()
                .map(CandidateFailure::toString)
                .collect(Collectors.joining("; ")));
        this.failures = List.copyOf(failures);
    }

    public List<CandidateFailure> getFailures() {
        return failures;
    }

    public boolean allFailedWith(FailureKind kind) {
        return !failures.isEmpty() && failures.stream().allMatch(failure -> failure.kind() == kind);
    }
}
