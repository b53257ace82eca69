/**
 * Smart-home framework port: endpoints, clusters and attribute values.
 */
package com.questrail.meshbridge.endpoint;
