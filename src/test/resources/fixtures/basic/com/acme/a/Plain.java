package com.acme.a;

import java.util.List;

// no assertions here
public class Plain {
    List<String>   names() { return List.of("a"); }
}
