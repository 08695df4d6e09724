/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.capv.operator.cluster.vsphere;

/**
 * vSphere tag attached to an inventory object
 *
 * @param name      Tag name
 * @param category  Name of the category the tag belongs to
 */
public record Tag(String name, String category) {
}
