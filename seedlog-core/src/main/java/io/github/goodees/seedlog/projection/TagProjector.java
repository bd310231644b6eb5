package io.github.goodees.seedlog.projection;

/*-
 * #%L
 * seedlog
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.seedlog.EntityKind;
import io.github.goodees.seedlog.TransactionRecord;
import io.github.goodees.seedlog.TransactionType;
import io.github.goodees.seedlog.store.TransactionLog;
import org.slf4j.Logger;

import static io.github.goodees.seedlog.Payloads.optionalText;
import static io.github.goodees.seedlog.Payloads.text;

public class TagProjector extends EntityProjector<TagState> {

    public TagProjector(TransactionLog log) {
        super(EntityKind.TAG, log);
    }

    public TagProjector(TransactionLog log, Logger logger) {
        super(EntityKind.TAG, log, logger);
    }

    @Override
    protected TagState initialState(TransactionRecord creation) {
        return ImmutableTagState.builder()
                .tagId(creation.getEntityId())
                .name(text(creation.getPayload(), "name"))
                .color(optionalText(creation.getPayload(), "color"))
                .createdAt(creation.getCreatedAt())
                .build();
    }

    @Override
    protected TransactionSwitch<TagState> defineReducers() {
        return TransactionSwitch.builder(TagState.class)
                .on(TransactionType.TAG_EDIT, (s, tx) -> ImmutableTagState.copyOf(s)
                        .withName(text(tx.getPayload(), "name")))
                .on(TransactionType.SET_COLOR, (s, tx) -> ImmutableTagState.copyOf(s)
                        .withColor(optionalText(tx.getPayload(), "color")))
                .build();
    }
}
