/**
 * Upstream source adapters and the catalog that maps configured names to them.
 */
package com.trendscope.trending.source;
