package com.permgroups;

public final class OptionsParser {

    public static final class Parsed {
        public final GroupDat dat;
        public final String inputPath;
        private Parsed(GroupDat d, String p){ dat=d; inputPath=p; }
    }

    private OptionsParser() {}

    public static Parsed parse(String[] args){
        GroupDat.Builder b = new GroupDat.Builder();
        String input = null;

        for (int i=0; i<args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-order": b.mode(GroupDat.Mode.ORDER); break;
                case "-base": b.mode(GroupDat.Mode.BASE); break;
                case "-chain": b.mode(GroupDat.Mode.CHAIN); break;
                case "-elements": b.mode(GroupDat.Mode.ELEMENTS); break;
                case "-words": b.mode(GroupDat.Mode.WORDS); break;
                case "-iterate": b.mode(GroupDat.Mode.ITERATE); break;
                case "-orbits": b.mode(GroupDat.Mode.ORBITS); break;
                case "-stats": b.printStats(true); break;
                case "-orbit": b.addOrbit(Integer.parseInt(value(args, ++i, a))); break;
                case "-member": b.addMember(Perm.parse(value(args, ++i, a))); break;
                case "-maxorder": b.maxOrder(Long.parseLong(value(args, ++i, a))); break;
                default:
                    if (a.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + a);
                    if (input != null) throw new IllegalArgumentException("Multiple inputs: " + a);
                    input = a;
            }
        }
        if (input == null) throw new IllegalArgumentException("Missing input file");
        return new Parsed(b.build(), input);
    }

    private static String value(String[] args, int i, String option){
        if (i >= args.length) throw new IllegalArgumentException("Option " + option + " needs a value");
        return args[i];
    }
}
