/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.arbo.api;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a structural node is created with a type label that cannot be
 * written in the notation.
 */
public class TreeException extends IllegalArgumentException {

    private static final long serialVersionUID = 6420217723374591541L;

    private final String type;

    public TreeException(@NotNull String message, @NotNull String type) {
        super(message);
        this.type = type;
    }

    /**
     * @return the rejected type label
     */
    @NotNull
    public String getType() {
        return type;
    }
}
