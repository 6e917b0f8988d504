/*
 * Copyright 2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"). You may not use this file except
 * in compliance with the License. A copy of the License is located at
 *
 * http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 */

package org.rocrate.encryption.envelope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The envelopes produced by one encode call and the recipient descriptors that link to them.
 */
public final class EncodeResult {

    private final List<EnvelopeRecord> envelopes;
    private final List<RecipientDescriptor> recipients;

    EncodeResult(final List<EnvelopeRecord> envelopes, final List<RecipientDescriptor> recipients) {
        this.envelopes = Collections.unmodifiableList(new ArrayList<>(envelopes));
        this.recipients = Collections.unmodifiableList(new ArrayList<>(recipients));
    }

    public List<EnvelopeRecord> getEnvelopes() {
        return envelopes;
    }

    public List<RecipientDescriptor> getRecipients() {
        return recipients;
    }
}
