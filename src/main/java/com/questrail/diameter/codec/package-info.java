/**
 * Diameter Header Codec
 * =============================================================================
 *
 * <p>This package defines the <strong>wire-level header</strong> of the
 * Diameter base protocol (RFC 6733 §3): a fixed 20-byte, big-endian structure
 * carrying the version, the 24-bit message length and command code, the
 * command flags and three 32-bit identifiers.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   socket bytes
 *        → HeaderCodec            (20 fixed bytes, version check)
 *            → MessageReader      (AVP payload bytes, length check)
 *                → Message
 *                    → Handler / ServeMux
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>{@link com.questrail.diameter.codec.CommandNames} is a display table
 *       only. Dispatch resolves commands through a
 *       {@link com.questrail.diameter.dict.Dictionary}.</li>
 *   <li>AVP encoding rules are not modelled here.</li>
 * </ul>
 */
package com.questrail.diameter.codec;
