/**
 * Normalization, feature extraction and scoring.
 */
package com.mimecast.phishguard.analysis;
