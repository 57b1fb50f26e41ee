/**
 * Spring configuration: typed properties and the worker executor.
 */
package com.phillippitts.hybridfactor.config;
