/**
 * Content schemas for room state events bundled with the default registry.
 */
package com.concord.events.room;
