package com.spreadsheet.engine.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /sheet/{id}/batch:
 * { "operations": [ {"type": "set", "address": "A1", "value": "42"}, {"type": "delete", "address": "B1"} ] }
 */
public class BatchRequest {

    private List<Operation> operations = new ArrayList<>();

    public List<Operation> getOperations() {
        return operations;
    }

    public void setOperations(List<Operation> operations) {
        this.operations = operations;
    }

    public static class Operation {
        // "set" or "delete"
        private String type;
        private String address;
        private String value;

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }
    }
}
