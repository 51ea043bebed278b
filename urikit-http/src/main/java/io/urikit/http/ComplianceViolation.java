//
// ========================================================================
// Copyright (c) 1995-2022 Mort Bay Consulting Pty Ltd and others.
//
// This program and the accompanying materials are made available under the
// terms of the Eclipse Public License v. 2.0 which is available at
// https://www.eclipse.org/legal/epl-2.0, or the Apache License, Version 2.0
// which is available at https://www.apache.org/licenses/LICENSE-2.0.
//
// SPDX-License-Identifier: EPL-2.0 OR Apache-2.0
// ========================================================================
//

package io.urikit.http;

import java.util.Set;

/**
 * A Compliance Violation represents a requirement of an RFC that may be relaxed
 * if it is included in a {@link ComplianceViolation.Mode}.
 * For example a URI that has an authority but a rootless path breaks
 * <a href="https://tools.ietf.org/html/rfc3986#section-3.3">RFC 3986 section 3.3</a>;
 * including {@link UriCompliance.Violation#AUTHORITY_RELATIVE_PATH} in a mode allows such a URI
 * to be corrected instead of rejected.
 */
public interface ComplianceViolation
{
    /**
     * @return The name of the violation.
     */
    String getName();

    /**
     * @return A URL to the specification that provides more information regarding the requirement that may be violated.
     */
    String getURL();

    /**
     * @return A short description of the violation.
     */
    String getDescription();

    /**
     * @param mode A {@link ComplianceViolation.Mode} to test against
     * @return True iff this violations is allowed by the mode.
     */
    default boolean isAllowedBy(Mode mode)
    {
        return mode.allows(this);
    }

    /**
     * A Mode is a set of {@link ComplianceViolation}s that are allowed.
     */
    interface Mode
    {
        String getName();

        /**
         * @param violation The {@link ComplianceViolation} to test
         * @return true iff the violation is allowed by this mode.
         */
        boolean allows(ComplianceViolation violation);

        /**
         * @return The immutable set of violations allowed by this mode.
         */
        Set<? extends ComplianceViolation> getAllowed();
    }

    /**
     * A listener that is notified every time an allowed violation is corrected.
     */
    interface Listener
    {
        /**
         * A listener that ignores all notifications.
         */
        Listener NOOP = new Listener()
        {
        };

        default void onComplianceViolation(Mode mode, ComplianceViolation violation, String details)
        {
        }
    }
}
