/**
 * Bridge persistence.
 *
 * <p>A flat, namespaced key-value port with staged writes and an explicit
 * commit, plus the JSON record layout the bridge keeps in it: one record per
 * device keyed by its identifier suffix and one global endpoint counter.</p>
 */
package com.questrail.meshbridge.store;
