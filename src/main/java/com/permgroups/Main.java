package com.permgroups;

public class Main {

    public static void main(String[] args) {
        int status = new GroupDriver().run(args);
        if (status != 0) System.exit(status);
    }
}
