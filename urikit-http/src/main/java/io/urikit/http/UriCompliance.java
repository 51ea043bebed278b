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

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableSet;
import static java.util.EnumSet.allOf;
import static java.util.EnumSet.noneOf;

/**
 * URI compliance modes for {@link HttpURI} construction and mutation.
 * A compliance mode consists of a set of {@link Violation}s which are corrected
 * rather than rejected when the mode is in use.
 */
public final class UriCompliance implements ComplianceViolation.Mode
{
    private static final Logger LOG = LoggerFactory.getLogger(UriCompliance.class);

    /**
     * Deviations from <a href="https://datatracker.ietf.org/doc/html/rfc3986">RFC 3986</a>
     * that {@link HttpURI} is able to correct.
     */
    public enum Violation implements ComplianceViolation
    {
        /**
         * Allow a rootless path with an authority e.g. {@code //host} with path {@code foo},
         * corrected by prefixing the path with {@code /}.
         */
        AUTHORITY_RELATIVE_PATH("https://tools.ietf.org/html/rfc3986#section-3.3", "Path of a URI with an authority does not start with a slash", true),
        /**
         * Allow an http or https URI without a host, corrected by using {@link HttpURI#HTTP_DEFAULT_HOST}.
         */
        DEFAULT_HTTP_HOST("https://tools.ietf.org/html/rfc7230#section-2.7.1", "Absolute http URI without a host", false);

        private final String _url;
        private final String _description;
        private final boolean _deprecated;

        Violation(String url, String description, boolean deprecated)
        {
            _url = url;
            _description = description;
            _deprecated = deprecated;
        }

        @Override
        public String getName()
        {
            return name();
        }

        @Override
        public String getURL()
        {
            return _url;
        }

        @Override
        public String getDescription()
        {
            return _description;
        }

        /**
         * @return true if the correction is deprecated and will become a rejection
         */
        public boolean isDeprecated()
        {
            return _deprecated;
        }
    }

    /**
     * The default compliance mode, which corrects every known {@link Violation}.
     */
    public static final UriCompliance DEFAULT = new UriCompliance("DEFAULT", allOf(Violation.class));

    /**
     * Compliance mode that exactly follows <a href="https://tools.ietf.org/html/rfc3986">RFC3986</a>,
     * rejecting every {@link Violation}.
     */
    public static final UriCompliance RFC3986 = new UriCompliance("RFC3986", noneOf(Violation.class));

    private static final AtomicInteger __custom = new AtomicInteger();
    private static final List<UriCompliance> KNOWN_MODES = List.of(DEFAULT, RFC3986);

    public static UriCompliance valueOf(String name)
    {
        for (UriCompliance compliance : KNOWN_MODES)
        {
            if (compliance.getName().equals(name))
                return compliance;
        }
        LOG.warn("Unknown UriCompliance mode {}", name);
        return null;
    }

    /**
     * Create compliance set from a set of allowed Violations.
     *
     * @param violations A set of violations to allow
     * @return the compliance mode
     */
    public static UriCompliance from(Set<Violation> violations)
    {
        return new UriCompliance("CUSTOM" + __custom.getAndIncrement(), violations);
    }

    /**
     * Create compliance set from string.
     * <p>
     * Format: &lt;BASE&gt;[,[-]&lt;violation&gt;]...
     * </p>
     * <p>BASE is one of:</p>
     * <dl>
     * <dt>0</dt><dd>No {@link Violation}s</dd>
     * <dt>*</dt><dd>All {@link Violation}s</dd>
     * <dt>&lt;name&gt;</dt><dd>The name of a static instance of UriCompliance (e.g. {@link UriCompliance#RFC3986}).
     * </dl>
     * <p>
     * The remainder of the list names {@link Violation}s to include in the mode, or prefixed
     * with a '-' to exclude from the mode, e.g. {@code RFC3986,DEFAULT_HTTP_HOST}.
     * </p>
     *
     * @param config A string describing the compliance
     * @return the UriCompliance instance derived from the string description
     * @throws IllegalArgumentException if a violation name is unknown
     */
    public static UriCompliance from(String config)
    {
        Set<Violation> violations;
        String[] elements = config.split("\\s*,\\s*");
        switch (elements[0])
        {
            case "0":
                violations = noneOf(Violation.class);
                break;

            case "*":
                violations = allOf(Violation.class);
                break;

            default:
            {
                UriCompliance mode = UriCompliance.valueOf(elements[0]);
                violations = (mode == null) ? noneOf(Violation.class) : copyOf(mode.getAllowed());
                break;
            }
        }

        for (int i = 1; i < elements.length; i++)
        {
            String element = elements[i];
            boolean exclude = element.startsWith("-");
            if (exclude)
                element = element.substring(1);
            Violation violation = Violation.valueOf(element);
            if (exclude)
                violations.remove(violation);
            else
                violations.add(violation);
        }

        UriCompliance compliance = new UriCompliance("CUSTOM" + __custom.getAndIncrement(), violations);
        if (LOG.isDebugEnabled())
            LOG.debug("UriCompliance from {}->{}", config, compliance);
        return compliance;
    }

    private final String _name;
    private final Set<Violation> _allowed;

    public UriCompliance(String name, Set<Violation> violations)
    {
        Objects.requireNonNull(violations);
        _name = name;
        _allowed = unmodifiableSet(copyOf(violations));
    }

    @Override
    public boolean allows(ComplianceViolation violation)
    {
        return violation instanceof Violation && _allowed.contains(violation);
    }

    @Override
    public String getName()
    {
        return _name;
    }

    /**
     * @return The immutable set of {@link Violation}s allowed by this compliance mode.
     */
    @Override
    public Set<Violation> getAllowed()
    {
        return _allowed;
    }

    /**
     * @param name The name of the new mode
     * @param violations The violations to include
     * @return A new {@link UriCompliance} mode that also allows the passed {@link Violation}s.
     */
    public UriCompliance with(String name, Violation... violations)
    {
        Set<Violation> union = copyOf(_allowed);
        union.addAll(List.of(violations));
        return new UriCompliance(name, union);
    }

    /**
     * @param name The name of the new mode
     * @param violations The violations to exclude
     * @return A new {@link UriCompliance} mode that rejects the passed {@link Violation}s.
     */
    public UriCompliance without(String name, Violation... violations)
    {
        Set<Violation> remainder = copyOf(_allowed);
        remainder.removeAll(List.of(violations));
        return new UriCompliance(name, remainder);
    }

    @Override
    public String toString()
    {
        return String.format("%s%s", _name, _allowed);
    }

    private static Set<Violation> copyOf(Set<Violation> violations)
    {
        if (violations == null || violations.isEmpty())
            return EnumSet.noneOf(Violation.class);
        return EnumSet.copyOf(violations);
    }
}
