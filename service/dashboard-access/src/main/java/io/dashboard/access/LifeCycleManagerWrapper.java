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
package io.dashboard.access;

import com.google.inject.Inject;
import io.airlift.bootstrap.LifeCycleManager;
import io.airlift.log.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * Indirection over the injector's {@link LifeCycleManager} so the service can
 * stop its managed objects without depending on Bootstrap directly. Only the
 * first {@link #stop()} has an effect.
 */
public class LifeCycleManagerWrapper
{
    private static final Logger log = Logger.get(LifeCycleManagerWrapper.class);

    private final LifeCycleManager lifeCycleManager;
    private final AtomicBoolean stopped = new AtomicBoolean();

    @Inject
    public LifeCycleManagerWrapper(LifeCycleManager lifeCycleManager)
    {
        this.lifeCycleManager = requireNonNull(lifeCycleManager, "lifeCycleManager is null");
    }

    public void stop()
    {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Stopping dashboard access service");
        lifeCycleManager.stop();
    }
}
