package com.xbleey.signalalert;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.signalalert.model.GoPlusResponse;
import com.xbleey.signalalert.model.GoPlusTokenSecurity;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class GoPlusResponseJsonTest {

    @Test
    void shouldDeserializeTokenSecurityJson() throws Exception {
        String json = """
                {
                  "code": 1,
                  "message": "OK",
                  "result": {
                    "0x1111111111111111111111111111111111111111": {
                      "is_honeypot": "1",
                      "is_mintable": "1",
                      "external_call": "0",
                      "buy_tax": "0.05",
                      "sell_tax": "0.12",
                      "holder_count": "1523"
                    }
                  }
                }
                """;

        GoPlusResponse response = new ObjectMapper().readValue(json, GoPlusResponse.class);

        Assertions.assertEquals(GoPlusResponse.CODE_OK, response.getCode());
        GoPlusTokenSecurity security = response.getResult().get("0x1111111111111111111111111111111111111111");
        Assertions.assertNotNull(security);
        Assertions.assertEquals("1", security.getHoneypot());
        Assertions.assertEquals("1", security.getMintable());
        Assertions.assertEquals("0", security.getExternalCall());
        Assertions.assertEquals("0.12", security.getSellTax());
        Assertions.assertNull(security.getHiddenOwner());
    }
}
