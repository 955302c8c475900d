package me.golemcore.nexus.adapter.outbound.tokenizer;

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

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingResult;
import com.knuddels.jtokkit.api.EncodingType;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.nexus.domain.prompt.TokenCounter;
import me.golemcore.nexus.infrastructure.config.NexusProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * BPE token counter backed by jtokkit. Falls back to {@code cl100k_base} when
 * the configured encoding is unknown.
 *
 * <p>
 * User text is encoded as ordinary text, so strings that look like special
 * tokens are counted instead of rejected.
 */
@Component
@Slf4j
public class JtokkitTokenCounter implements TokenCounter {

    private final Encoding encoding;

    @Autowired
    public JtokkitTokenCounter(NexusProperties properties) {
        this(properties.getPrompt().getTokenizerEncoding());
    }

    public JtokkitTokenCounter(String encodingName) {
        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
        EncodingType type = EncodingType.fromName(encodingName).orElseGet(() -> {
            log.warn("[Tokenizer] Unknown encoding '{}', using cl100k_base", encodingName);
            return EncodingType.CL100K_BASE;
        });
        this.encoding = registry.getEncoding(type);
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return encoding.countTokensOrdinary(text);
    }

    @Override
    public String truncate(String text, int maxTokens) {
        if (text == null || text.isEmpty() || maxTokens <= 0) {
            return "";
        }
        EncodingResult result = encoding.encodeOrdinary(text, maxTokens);
        if (!result.isTruncated()) {
            return text;
        }
        return encoding.decode(result.getTokens());
    }
}
