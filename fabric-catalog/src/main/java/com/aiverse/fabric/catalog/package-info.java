/**
 * Multi-tenant data catalog: namespace hierarchy and isolation ({@link com.aiverse.fabric.catalog.CatalogNamespaceManager}),
 * tag governance ({@code tags}) and drift control policies ({@code drift}).
 */
package com.aiverse.fabric.catalog;
