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

package me.golemcore.recall.domain.context;

import me.golemcore.recall.domain.model.OwnerContext;

/**
 * ThreadLocal holder for the owner of the current agent turn, so that tools can
 * resolve their store keys without explicit parameter passing. Values do not
 * propagate to async operations; tools read it on the calling thread.
 */
public class OwnerContextHolder {

    private static final ThreadLocal<OwnerContext> CONTEXT = new ThreadLocal<>();

    public static void set(OwnerContext ctx) {
        CONTEXT.set(ctx);
    }

    public static OwnerContext get() {
        return CONTEXT.get();
    }

    public static void clear() {
        CONTEXT.remove();
    }

    private OwnerContextHolder() {
    }
}
