/*
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
 */
package io.dashboard.access.audit;

import io.airlift.json.JsonCodec;
import io.airlift.json.JsonCodecFactory;
import io.airlift.log.Logger;

/**
 * Writes each event as one JSON line to the {@code audit} logger.
 */
public class LoggingAuditSink
        implements AuditSink
{
    private static final Logger auditLog = Logger.get("audit");
    private static final JsonCodec<AuditEvent> AUDIT_EVENT_CODEC = new JsonCodecFactory().jsonCodec(AuditEvent.class);

    @Override
    public void emit(AuditEvent event)
    {
        auditLog.info("%s", toJson(event));
    }

    static String toJson(AuditEvent event)
    {
        return AUDIT_EVENT_CODEC.toJson(event);
    }
}
