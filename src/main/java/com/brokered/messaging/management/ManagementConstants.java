/*
 * Copyright 2010-2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed
 * on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either
 * express or implied. See the License for the specific language governing
 * permissions and limitations under the License.
 */
package com.brokered.messaging.management;

/**
 * Keys, operation names and status codes of the broker's management endpoint.
 * These strings are matched verbatim by the broker.
 */
public final class ManagementConstants {

    public static final String VENDOR_PREFIX = "com.microsoft";

    public static final String OPERATION = "operation";

    private ManagementConstants() {
    }

    public static final class Response {
        public static final String STATUS_CODE = "statusCode";
        public static final String STATUS_DESCRIPTION = "statusDescription";
        public static final String ERROR_CONDITION = "errorCondition";

        private Response() {
        }
    }

    public static final class Operations {
        public static final String RENEW_LOCK = VENDOR_PREFIX + ":renew-lock";
        public static final String RECEIVE_BY_SEQUENCE_NUMBER = VENDOR_PREFIX + ":receive-by-sequence-number";
        public static final String UPDATE_DISPOSITION = VENDOR_PREFIX + ":update-disposition";
        public static final String RENEW_SESSION_LOCK = VENDOR_PREFIX + ":renew-session-lock";
        public static final String SET_SESSION_STATE = VENDOR_PREFIX + ":set-session-state";
        public static final String GET_SESSION_STATE = VENDOR_PREFIX + ":get-session-state";
        public static final String PEEK_MESSAGE = VENDOR_PREFIX + ":peek-message";

        private Operations() {
        }
    }

    public static final class Properties {
        public static final String SERVER_TIMEOUT = VENDOR_PREFIX + ":server-timeout";
        public static final String TRACKING_ID = VENDOR_PREFIX + ":tracking-id";

        public static final String SESSION_STATE = "session-state";
        public static final String LOCK_TOKEN = "lock-token";
        public static final String LOCK_TOKENS = "lock-tokens";
        public static final String SEQUENCE_NUMBERS = "sequence-numbers";
        public static final String EXPIRATIONS = "expirations";
        public static final String EXPIRATION = "expiration";
        public static final String SESSION_ID = "session-id";

        public static final String RECEIVER_SETTLE_MODE = "receiver-settle-mode";
        public static final String MESSAGE = "message";
        public static final String MESSAGES = "messages";
        public static final String DISPOSITION_STATUS = "disposition-status";

        public static final String FROM_SEQUENCE_NUMBER = "from-sequence-number";
        public static final String MESSAGE_COUNT = "message-count";

        private Properties() {
        }
    }

    public static final class StatusCodes {
        public static final int OK = 200;
        public static final int NO_CONTENT = 204;

        private StatusCodes() {
        }
    }

    public static final class Conditions {
        public static final String MESSAGE_LOCK_LOST = VENDOR_PREFIX + ":message-lock-lost";
        public static final String SESSION_LOCK_LOST = VENDOR_PREFIX + ":session-lock-lost";
        public static final String TIMEOUT = VENDOR_PREFIX + ":timeout";
        public static final String NOT_FOUND = "amqp:not-found";
        public static final String UNAUTHORIZED_ACCESS = "amqp:unauthorized-access";

        private Conditions() {
        }
    }
}
