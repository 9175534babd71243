/**
 * Default implementations of the Modbus TCP codec ports.
 *
 * <p>Byte offsets and the MBAP header layout are kept package-private in
 * {@code MbapHeader}; nothing outside this package reasons about them.</p>
 */
package com.questrail.modbus.codec.impl;
