/**
 * REST controllers. Request parsing only; all work is delegated to the service layer.
 */
package com.phillippitts.hybridfactor.presentation.controller;
