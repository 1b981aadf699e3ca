package com.edudata.authservice.model;

/**
 * A fresh one-time code and the opaque session token that references its challenge.
 * The code goes to the user's contact only; the token goes back to the client.
 */
public record GeneratedOtc(String code, String sessionToken) {

    @Override
    public String toString() {
        return "GeneratedOtc[code=***, sessionToken=***]";
    }
}
