package com.edudata.authservice.service;

import com.edudata.authservice.model.GeneratedOtc;

public interface OtcGenerator {

    /**
     * @param length number of digits in the code
     * @return a uniformly random zero-padded code and an independent 256-bit hex session token
     */
    GeneratedOtc generate(int length);
}
